package com.edugen.ai.tts;

import com.edugen.ai.provider.AiProvider;
import com.edugen.ai.provider.ProviderException;
import com.edugen.ai.tts.model.AudioOptions;
import com.edugen.ai.tts.model.AudioResult;
import com.edugen.ai.tts.model.Voice;

public interface TtsProviderClient extends AiProvider {
    
    AudioResult synthesize(String text, Voice voice, AudioOptions options) throws ProviderException;
    
    TtsProvider getProvider();
    
    @Override
    default String getName() {
        return getProvider().getDisplayName();
    }
}
