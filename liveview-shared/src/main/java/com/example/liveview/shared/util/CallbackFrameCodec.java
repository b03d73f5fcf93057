package com.example.liveview.shared.util;

import com.example.liveview.shared.exception.MalformedFrameException;
import com.example.liveview.shared.model.CallbackInvocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes inbound callback invocations.
 * <ul>
 *   <li>Line frames: {@code "<id>:<json-array-of-args>"} or a bare {@code "<id>"}.</li>
 *   <li>POST bodies: a JSON array {@code [id, arg1, arg2, ...]}.</li>
 * </ul>
 */
@RequiredArgsConstructor
public class CallbackFrameCodec {

    private static final TypeReference<List<Object>> ARGS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public CallbackInvocation parseFrame(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new MalformedFrameException("Empty callback frame", frame);
        }
        int idx = frame.indexOf(':');
        String idPart = idx >= 0 ? frame.substring(0, idx) : frame;
        long id;
        try {
            id = Long.parseLong(idPart.trim());
        } catch (NumberFormatException e) {
            throw new MalformedFrameException("Callback id is not a number: '" + idPart + "'", frame);
        }
        if (idx < 0) {
            return new CallbackInvocation(id, List.of());
        }
        return new CallbackInvocation(id, readArgs(frame.substring(idx + 1), frame));
    }

    public CallbackInvocation parseBody(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedFrameException("Empty callback body", body);
        }
        List<Object> values = readArgs(body, body);
        if (values.isEmpty()) {
            throw new MalformedFrameException("Callback body has no callback id", body);
        }
        Object first = values.get(0);
        if (!(first instanceof Integer || first instanceof Long || first instanceof BigInteger)) {
            throw new MalformedFrameException("Callback id is not an integer: " + first, body);
        }
        if (first instanceof BigInteger big && big.bitLength() >= Long.SIZE) {
            throw new MalformedFrameException("Callback id is out of range: " + first, body);
        }
        return new CallbackInvocation(((Number) first).longValue(), new ArrayList<>(values.subList(1, values.size())));
    }

    private List<Object> readArgs(String json, String frame) {
        try {
            List<Object> args = objectMapper.readValue(json, ARGS);
            if (args == null) {
                throw new MalformedFrameException("Callback arguments must be a JSON array", frame);
            }
            return args;
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Callback arguments are not a JSON array: " + e.getOriginalMessage(), frame);
        }
    }
}
