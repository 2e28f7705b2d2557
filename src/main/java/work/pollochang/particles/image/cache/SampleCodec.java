package work.pollochang.particles.image.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import work.pollochang.particles.image.core.Sample;

import java.io.IOException;
import java.util.List;

/**
 * 取樣點清單與 payload 位元組之間的轉換 (JSON)。
 */
public final class SampleCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Sample>> SAMPLE_LIST = new TypeReference<>() {};

    private SampleCodec() {}

    public static byte[] encode(List<Sample> samples) throws IOException {
        return MAPPER.writeValueAsBytes(samples);
    }

    public static List<Sample> decode(byte[] payload) throws IOException {
        return MAPPER.readValue(payload, SAMPLE_LIST);
    }
}
