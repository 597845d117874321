package com.acme.cow.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON form of a metrics snapshot, one flat object per container.
 */
public final class SnapshotJsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SnapshotJsonCodec() {
    }

    public static String write(String containerName, AtomicCowMetrics.Snapshot s) throws JsonProcessingException {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("component", "copy-on-write");
        node.put("container", containerName);
        node.put("reads", s.reads());
        node.put("writesApplied", s.writesApplied());
        node.put("verifierRejected", s.verifierRejected());
        node.put("constructionFailed", s.constructionFailed());
        node.put("lockBusy", s.lockBusy());
        node.put("writeErrors", s.writeErrors());
        node.put("drainIterationsTotal", s.drainIterationsTotal());
        node.put("drainSamples", s.drainSamples());
        node.put("drainIterationsMax", s.drainIterationsMax());
        node.put("cellsDisposed", s.cellsDisposed());
        return MAPPER.writeValueAsString(node);
    }

    public static JsonNode read(String raw) throws JsonProcessingException {
        return MAPPER.readTree(raw);
    }
}
