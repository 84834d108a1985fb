package com.edugen.core.generation;

import com.edugen.core.generation.model.ActivityItem;
import com.edugen.core.generation.model.GeneratedActivity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The only way an activity leaves this service for a student: a JSON copy of the
 * authoring view without the fields each item's type marks as answer-bearing.
 */
@Component
@RequiredArgsConstructor
public class ActivityRedactor {
    
    private final ObjectMapper objectMapper;
    
    public ObjectNode toAuthoringView(GeneratedActivity activity) {
        return objectMapper.valueToTree(activity);
    }
    
    public ObjectNode toPublicView(GeneratedActivity activity) {
        ObjectNode view = toAuthoringView(activity);
        view.remove(List.of("provider", "model"));
        
        JsonNode items = view.get(activity.getType().getRootKey());
        List<ActivityItem> source = activity.getItems();
        for (int i = 0; i < source.size() && items != null && i < items.size(); i++) {
            JsonNode node = items.get(i);
            if (node.isObject()) {
                ((ObjectNode) node).remove(source.get(i).getType().answerBearingFields());
            }
        }
        return view;
    }
}
