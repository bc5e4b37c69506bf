package com.example.distcache.redis;

import com.example.distcache.core.CacheSerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON encoding of cache values. Integers encode as bare numbers, which keeps them usable by
 * INCRBY. Map entries are written sorted by key, so equal values always encode to the same
 * text and compare-and-swap can compare encodings directly.
 */
public class RedisValueCodec {

    private final ObjectMapper mapper;

    public RedisValueCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public String encode(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException("cannot encode value of type " + value.getClass().getName(), e);
        }
    }

    public Object decode(String json) {
        if (json == null) {
            return null;
        }
        try {
            return mapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException("cannot decode stored value", e);
        }
    }
}
