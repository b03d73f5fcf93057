package com.example.liveview.server.service;

import com.example.liveview.shared.model.Patch;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Serializes a patch batch into one outbound frame:
 * {@code [{"targetId":3,"mode":"replace","payload":"<b>1</b>"}, {"targetId":7,"mode":"delete"}]}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PatchEncoder {

    private final ObjectMapper objectMapper;

    public String encode(List<Patch> batch) {
        ArrayNode records = objectMapper.createArrayNode();
        for (Patch patch : batch) {
            ObjectNode record = objectMapper.createObjectNode();
            record.put("targetId", patch.targetId());
            record.put("mode", patch.wireMode());
            if (!patch.isDelete()) {
                try {
                    record.set("payload", objectMapper.valueToTree(patch.payload().value()));
                } catch (IllegalArgumentException e) {
                    log.error("Error serializing payload of patch for component {}: {}", patch.targetId(), e.getMessage());
                    continue;
                }
            }
            records.add(record);
        }
        try {
            return objectMapper.writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Patch batch could not be serialized", e);
        }
    }
}
