package com.workflow.bsp.checkpoint;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.bsp.channel.Channel;
import com.workflow.bsp.channel.ChannelRegistry;
import com.workflow.bsp.error.ChannelSerializationException;
import com.workflow.bsp.error.CheckpointException;
import com.workflow.bsp.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Converts channel checkpoints to and from Jackson trees. Each channel
 * describes the Java type of its checkpoint, which drives decoding.
 */
@Log4j2
public final class ChannelCheckpointCodec {
    private final ObjectMapper mapper;

    public ChannelCheckpointCodec() {
        this(Jsons.mapper());
    }

    public ChannelCheckpointCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Encodes the checkpoints of all tracked channels.
     *
     * @throws ChannelSerializationException if a checkpoint cannot be converted
     */
    public Map<String, JsonNode> encode(ChannelRegistry registry) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : registry.checkpointAll().entrySet())
            out.put(e.getKey(), encode(e.getKey(), e.getValue()));
        return out;
    }

    public JsonNode encode(String channel, Object checkpoint) {
        try {
            return mapper.valueToTree(checkpoint);
        } catch (IllegalArgumentException e) {
            throw new ChannelSerializationException(channel, "cannot encode checkpoint", e);
        }
    }

    /**
     * Restores every channel present in {@code encoded}. Names the registry
     * does not know are skipped.
     *
     * @throws ChannelSerializationException if a checkpoint cannot be decoded
     */
    public void decode(ChannelRegistry registry, Map<String, JsonNode> encoded) {
        for (Map.Entry<String, JsonNode> e : encoded.entrySet()) {
            if (!registry.contains(e.getKey())) {
                log.warn("Ignoring checkpoint of unknown channel '{}'", e.getKey());
                continue;
            }
            registry.restore(e.getKey(), decode(registry.channel(e.getKey()), e.getValue()));
        }
    }

    public Object decode(Channel<?, ?, ?> channel, JsonNode node) {
        if (node == null || node.isNull())
            return null;
        JavaType type = channel.checkpointType(mapper.getTypeFactory());
        try {
            return mapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new ChannelSerializationException(channel.name(), "cannot decode checkpoint as " + type, e);
        }
    }

    /**
     * Encodes a send payload together with its runtime type.
     *
     * @throws CheckpointException if the payload cannot be converted
     */
    public PendingSend encodeSend(String node, Object payload) {
        if (payload == null)
            return new PendingSend(node, null, null);
        try {
            return new PendingSend(node, payload.getClass().getName(), mapper.valueToTree(payload));
        } catch (IllegalArgumentException e) {
            throw new CheckpointException("Cannot encode payload of send to " + node, e);
        }
    }

    public Object decodeSend(PendingSend send) {
        if (send.payloadType() == null || send.payload() == null)
            return null;
        try {
            return mapper.convertValue(send.payload(), Class.forName(send.payloadType()));
        } catch (ClassNotFoundException | IllegalArgumentException e) {
            throw new CheckpointException("Cannot decode payload of send to " + send.node() + " as "
                    + send.payloadType(), e);
        }
    }
}
