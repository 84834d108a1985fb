package com.edugen.ai.tts;

import com.edugen.ai.tts.model.AudioOptions;
import com.edugen.ai.tts.model.Voice;

/**
 * SSML documents for the speech vendors.
 */
public final class Ssml {
    
    private Ssml() {}
    
    public static String build(String text, Voice voice, AudioOptions options) {
        String body = escape(text);
        String rate = ratePercent(options.getRate());
        String pitch = pitchPercent(options.getPitch());
        
        StringBuilder prosody = new StringBuilder();
        if (rate != null) {
            prosody.append(" rate=\"").append(rate).append('"');
        }
        if (pitch != null) {
            prosody.append(" pitch=\"").append(pitch).append('"');
        }
        if (prosody.length() > 0) {
            body = "<prosody" + prosody + ">" + body + "</prosody>";
        }
        
        return "<speak version=\"1.0\" xmlns=\"http://www.w3.org/2001/10/synthesis\" xml:lang=\"" + voice.locale() + "\">"
            + "<voice name=\"" + voice.id() + "\">" + body + "</voice></speak>";
    }
    
    /**
     * Multiplier to a signed percent offset, null when unchanged.
     */
    static String ratePercent(double rate) {
        if (rate == 1.0) {
            return null;
        }
        return String.format("%+d%%", Math.round((rate - 1.0) * 100));
    }
    
    // Pitch uses half the range of rate
    static String pitchPercent(double pitch) {
        if (pitch == 1.0) {
            return null;
        }
        return String.format("%+d%%", Math.round((pitch - 1.0) * 50));
    }
    
    static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&': out.append("&amp;"); break;
                case '<': out.append("&lt;"); break;
                case '>': out.append("&gt;"); break;
                case '"': out.append("&quot;"); break;
                case '\'': out.append("&apos;"); break;
                default: out.append(c);
            }
        }
        return out.toString();
    }
}
