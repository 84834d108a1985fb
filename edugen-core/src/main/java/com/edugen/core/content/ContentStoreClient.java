package com.edugen.core.content;

import com.edugen.core.content.model.BookProcessingMetadata;
import com.edugen.core.content.model.ModuleDetail;
import com.edugen.core.content.model.ModulesMetadata;
import com.edugen.core.content.model.VocabularyList;

import java.util.Optional;

/**
 * Read-only access to the AI data the content store extracted from a book.
 * Empty results mean the book or module does not exist.
 *
 * @throws ContentStoreException on authentication or connection failures
 */
public interface ContentStoreClient {
    
    Optional<BookProcessingMetadata> getProcessingMetadata(long bookId);
    
    Optional<ModulesMetadata> getModulesMetadata(long bookId);
    
    Optional<ModuleDetail> getModuleDetail(long bookId, long moduleId);
    
    Optional<VocabularyList> getVocabulary(long bookId, Long moduleId);
}
