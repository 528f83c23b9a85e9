package eu.lieko.store.json;

import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonCodecTest {

    private final JsonCodec codec = new JsonCodec();

    @Test
    void reads_integral_numbers_as_long() {
        Map<String, Object> map = this.codec.readObject("{\"a\":1,\"b\":1.5,\"c\":1e3,\"d\":12345678901234567890}");
        assertThat(map.get("a")).isEqualTo(1L);
        assertThat(map.get("b")).isEqualTo(1.5);
        assertThat(map.get("c")).isEqualTo(1000.0);
        assertThat(map.get("d")).isInstanceOf(Double.class);
    }

    @Test
    void keeps_key_order_and_nulls() {
        Map<String, Object> map = this.codec.readObject("{\"z\":null,\"a\":[true,\"x\",{}]}");
        assertThat(map).containsOnlyKeys("z", "a");
        assertThat(map.keySet()).containsExactly("z", "a");
        assertThat(map.get("z")).isNull();
        assertThat((List<Object>) map.get("a")).containsExactly(true, "x", new LinkedHashMap<>());
    }

    @Test
    void rejects_malformed_input() {
        assertThatThrownBy(() -> this.codec.read("{\"a\":")).isInstanceOf(JsonParseException.class);
        assertThatThrownBy(() -> this.codec.read("{\"a\":1}}")).isInstanceOf(JsonParseException.class);
        assertThatThrownBy(() -> this.codec.read("{a:1}")).isInstanceOf(JsonParseException.class);
        assertThatThrownBy(() -> this.codec.readObject("[1]")).isInstanceOf(JsonParseException.class);
    }

    @Test
    void writes_nulls_and_nested_values() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", "<Bob>");
        map.put("nickname", null);
        map.put("tags", Arrays.asList(1L, 2.5));

        String json = this.codec.write(map);

        assertThat(json).contains("\"nickname\": null");
        assertThat(json).contains("\"<Bob>\"");
        assertThat(this.codec.read(json)).isEqualTo(map);
    }
}
