package io.paxbridge.rpc;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.paxbridge.utils.Bits256;

import java.io.IOException;

public class RpcJsonMapper {

    private static final ObjectMapper mapper;

    static {
        var module = new SimpleModule();
        module.addSerializer(Bits256.class, new Bits256Serializer());
        mapper = new ObjectMapper();
        mapper.registerModule(module);
        // amounts are decimals with 8 fractional digits, keep them exact
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    private RpcJsonMapper() {
        // prevent instatiation
    }

    public static ObjectMapper getMapper() {
        // return copy to prevent outside modification of the mapper
        return mapper.copy();
    }

    private static class Bits256Serializer extends JsonSerializer<Bits256> {
        @Override
        public void serialize(Bits256 value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(value.toHex());
        }
    }
}
