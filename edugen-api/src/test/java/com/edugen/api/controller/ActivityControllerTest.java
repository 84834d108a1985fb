package com.edugen.api.controller;

import com.edugen.ai.tts.TtsProvider;
import com.edugen.ai.tts.model.AudioFormat;
import com.edugen.ai.tts.model.AudioResult;
import com.edugen.api.exception.GlobalExceptionHandler;
import com.edugen.core.activity.ActivityAudioService;
import com.edugen.core.activity.ActivityNotFoundException;
import com.edugen.core.activity.AudioSynthesisReport;
import com.edugen.core.generation.GenerationOrchestrator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ActivityControllerTest {
    
    @Mock
    private GenerationOrchestrator orchestrator;
    
    @Mock
    private ActivityAudioService audioService;
    
    @InjectMocks
    private ActivityController controller;
    
    private final ObjectMapper mapper = new ObjectMapper();
    private MockMvc mockMvc;
    
    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }
    
    @Test
    void should_ReturnPublicView_When_ActivityExists() throws Exception {
        ObjectNode view = mapper.createObjectNode();
        view.put("activity_id", "act-1");
        view.putArray("sentences").addObject().put("item_id", "s-0");
        when(orchestrator.publicView("act-1")).thenReturn(view);
        
        mockMvc.perform(get("/api/v1/ai/activities/act-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.activity_id").value("act-1"))
            .andExpect(jsonPath("$.sentences[0].item_id").value("s-0"));
    }
    
    @Test
    void should_Return404_When_ActivityExpiredOrUnknown() throws Exception {
        when(orchestrator.publicView("gone")).thenThrow(new ActivityNotFoundException("gone"));
        
        mockMvc.perform(get("/api/v1/ai/activities/gone"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.details.activity_id").value("gone"))
            .andExpect(jsonPath("$.path").value("/api/v1/ai/activities/gone"));
    }
    
    @Test
    void should_ReturnAuthoringView_When_Requested() throws Exception {
        ObjectNode view = mapper.createObjectNode();
        view.put("activity_id", "act-1");
        view.putArray("sentences").addObject().put("correct_sentence", "I like green apples");
        when(orchestrator.authoringView("act-1")).thenReturn(view);
        
        mockMvc.perform(get("/api/v1/ai/activities/act-1/authoring"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sentences[0].correct_sentence").value("I like green apples"));
    }
    
    @Test
    void should_ReturnSynthesisReport_When_AudioRequested() throws Exception {
        when(audioService.synthesizePending("act-1", "teacher-7"))
            .thenReturn(new AudioSynthesisReport("act-1", 3, 2, 1, 420));
        
        mockMvc.perform(post("/api/v1/ai/activities/act-1/audio").header("X-Teacher-Id", "teacher-7"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pending").value(3))
            .andExpect(jsonPath("$.ready").value(2))
            .andExpect(jsonPath("$.failed").value(1));
    }
    
    @Test
    void should_AcceptAudioRequest_When_TeacherHeaderAbsent() throws Exception {
        when(audioService.synthesizePending(eq("act-1"), isNull()))
            .thenReturn(new AudioSynthesisReport("act-1", 0, 0, 0, 1));
        
        mockMvc.perform(post("/api/v1/ai/activities/act-1/audio"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pending").value(0));
    }
    
    @Test
    void should_StreamItemAudio_When_ItemHasAudio() throws Exception {
        byte[] bytes = {1, 2, 3, 4};
        when(audioService.itemAudio("act-1", "s-0")).thenReturn(AudioResult.builder()
            .audio(bytes)
            .format(AudioFormat.MP3)
            .provider(TtsProvider.EDGE)
            .cached(true)
            .build());
        
        mockMvc.perform(get("/api/v1/ai/activities/act-1/items/s-0/audio"))
            .andExpect(status().isOk())
            .andExpect(header().string("Content-Type", "audio/mpeg"))
            .andExpect(header().exists("Cache-Control"))
            .andExpect(content().bytes(bytes));
    }
    
    @Test
    void should_Return404_When_ItemUnknown() throws Exception {
        when(audioService.itemAudio("act-1", "nope"))
            .thenThrow(new ActivityNotFoundException("act-1", "Item nope not found in activity act-1"));
        
        mockMvc.perform(get("/api/v1/ai/activities/act-1/items/nope/audio"))
            .andExpect(status().isNotFound());
    }
}
