package com.edugen.core.generation.model;

/**
 * Item whose content is meant to be heard. Audio is produced after generation.
 */
public interface AudioItem {
    
    String getItemId();
    
    /** The text to synthesize. Answer-bearing, so never part of the public view. */
    String spokenText();
    
    AudioStatus getAudioStatus();
    
    void setAudioStatus(AudioStatus status);
    
    String getAudioUrl();
    
    void setAudioUrl(String url);
}
