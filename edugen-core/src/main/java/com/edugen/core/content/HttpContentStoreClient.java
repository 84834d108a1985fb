package com.edugen.core.content;

import com.edugen.core.content.model.BookProcessingMetadata;
import com.edugen.core.content.model.ModuleDetail;
import com.edugen.core.content.model.ModulesMetadata;
import com.edugen.core.content.model.VocabularyList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

@Component
@Slf4j
public class HttpContentStoreClient implements ContentStoreClient {
    
    private final WebClient webClient;
    private final ContentStoreProperties properties;
    
    public HttpContentStoreClient(WebClient.Builder webClientBuilder, ContentStoreProperties properties) {
        this.properties = properties;
        WebClient.Builder builder = webClientBuilder.clone().baseUrl(properties.getBaseUrl());
        if (properties.getApiToken() != null && !properties.getApiToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiToken());
        }
        this.webClient = builder.build();
    }
    
    @Override
    public Optional<BookProcessingMetadata> getProcessingMetadata(long bookId) {
        return get(bookId, "metadata", BookProcessingMetadata.class,
            uri -> uri.path("/books/{bookId}/ai-data/metadata").build(bookId));
    }
    
    @Override
    public Optional<ModulesMetadata> getModulesMetadata(long bookId) {
        return get(bookId, "modules-metadata", ModulesMetadata.class,
            uri -> uri.path("/books/{bookId}/ai-data/modules/metadata").build(bookId));
    }
    
    @Override
    public Optional<ModuleDetail> getModuleDetail(long bookId, long moduleId) {
        return get(bookId, "module-detail", ModuleDetail.class,
            uri -> uri.path("/books/{bookId}/ai-data/modules/{moduleId}").build(bookId, moduleId));
    }
    
    @Override
    public Optional<VocabularyList> getVocabulary(long bookId, Long moduleId) {
        return get(bookId, "vocabulary", VocabularyList.class, uri -> {
            UriBuilder builder = uri.path("/books/{bookId}/ai-data/vocabulary");
            if (moduleId != null) {
                builder.queryParam("module", moduleId);
            }
            return builder.build(bookId);
        });
    }
    
    private <T> Optional<T> get(long bookId, String resource, Class<T> type, Function<UriBuilder, URI> uri) {
        long startTime = System.currentTimeMillis();
        try {
            T body = webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(type)
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .block();
            log.debug("[CONTENT_STORE] Fetched | bookId={} | resource={} | durationMs={}", 
                bookId, resource, System.currentTimeMillis() - startTime);
            return Optional.ofNullable(body);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                log.info("[CONTENT_STORE] Not found | bookId={} | resource={}", bookId, resource);
                return Optional.empty();
            }
            throw mapHttpError(bookId, resource, e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            log.error("[CONTENT_STORE] Request failed | bookId={} | resource={} | durationMs={} | error={}", 
                bookId, resource, System.currentTimeMillis() - startTime, cause.toString());
            throw new ContentStoreException("Content store unreachable while fetching " + resource + ": " 
                + cause.getMessage(), ContentStoreException.Kind.CONNECTION, bookId, cause);
        }
    }
    
    private ContentStoreException mapHttpError(long bookId, String resource, WebClientResponseException e) {
        int status = e.getStatusCode().value();
        log.error("[CONTENT_STORE] HTTP error | bookId={} | resource={} | statusCode={}", bookId, resource, status);
        if (status == 401 || status == 403) {
            return new ContentStoreException("Content store rejected credentials (" + status + ")",
                ContentStoreException.Kind.AUTH, bookId, e);
        }
        return new ContentStoreException("Content store error " + status + " while fetching " + resource,
            ContentStoreException.Kind.CONNECTION, bookId, e);
    }
}
