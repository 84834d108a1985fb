package com.edugen.core.activity;

import com.edugen.ai.tts.TtsManager;
import com.edugen.ai.tts.model.AudioOptions;
import com.edugen.ai.tts.model.AudioResult;
import com.edugen.ai.tts.model.BatchAudioResult;
import com.edugen.ai.usage.UsageContext;
import com.edugen.core.generation.model.AudioItem;
import com.edugen.core.generation.model.AudioStatus;
import com.edugen.core.generation.model.GeneratedActivity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Voices the listening items of a stored activity. Runs after generation, on request,
 * so slow speech synthesis never holds up text generation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ActivityAudioService {
    
    private final ActivityStore activityStore;
    private final TtsManager ttsManager;
    
    public AudioSynthesisReport synthesizePending(String activityId, String teacherId) {
        long startTime = System.currentTimeMillis();
        GeneratedActivity activity = activityStore.require(activityId);
        List<AudioItem> pending = activity.getAudioItems().stream()
            .filter(item -> item.getAudioStatus() == AudioStatus.PENDING)
            .collect(Collectors.toList());
        
        if (pending.isEmpty()) {
            log.info("[ACTIVITY_AUDIO] Nothing to synthesize | activityId={}", activityId);
            return new AudioSynthesisReport(activityId, 0, 0, 0, 0);
        }
        
        List<String> texts = pending.stream().map(AudioItem::spokenText).collect(Collectors.toList());
        BatchAudioResult batch = ttsManager.synthesizeBatch(texts, options(activity),
            UsageContext.of(teacherId, activity.getType().slug()));
        
        int ready = 0;
        for (BatchAudioResult.Item result : batch.items()) {
            AudioItem item = pending.get(result.index());
            if (result.isSuccess()) {
                item.setAudioStatus(AudioStatus.READY);
                item.setAudioUrl(audioUrl(activityId, item.getItemId()));
                ready++;
            } else {
                item.setAudioStatus(AudioStatus.FAILED);
                log.warn("[ACTIVITY_AUDIO] Item synthesis failed | activityId={} | itemId={} | error={}", 
                    activityId, item.getItemId(), result.error());
            }
        }
        activityStore.save(activity);
        
        long duration = System.currentTimeMillis() - startTime;
        log.info("[ACTIVITY_AUDIO] Synthesis finished | activityId={} | pending={} | ready={} | failed={} | durationMs={}", 
            activityId, pending.size(), ready, pending.size() - ready, duration);
        return new AudioSynthesisReport(activityId, pending.size(), ready, pending.size() - ready, duration);
    }
    
    /**
     * Audio for one item. Served from the audio cache when the item was voiced before.
     */
    public AudioResult itemAudio(String activityId, String itemId) {
        GeneratedActivity activity = activityStore.require(activityId);
        AudioItem item = activity.getAudioItems().stream()
            .filter(candidate -> itemId.equals(candidate.getItemId()))
            .findFirst()
            .orElseThrow(() -> new ActivityNotFoundException(activityId,
                "Item " + itemId + " of activity " + activityId + " has no audio"));
        return ttsManager.synthesize(item.spokenText(), options(activity),
            UsageContext.of(null, activity.getType().slug()));
    }
    
    static String audioUrl(String activityId, String itemId) {
        return "/api/v1/ai/activities/" + activityId + "/items/" + itemId + "/audio";
    }
    
    private static AudioOptions options(GeneratedActivity activity) {
        String language = activity.getLanguage() == null ? "en" : activity.getLanguage();
        return AudioOptions.forLanguage(language);
    }
}
