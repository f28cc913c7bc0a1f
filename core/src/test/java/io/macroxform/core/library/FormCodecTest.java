package io.macroxform.core.library;

import static io.macroxform.core.testkit.FormReader.read;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.macroxform.core.form.Atom;
import io.macroxform.core.form.Form;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FormCodecTest")
class FormCodecTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static Form decode(String json) throws Exception {
        return FormCodec.decode(JSON.readTree(json));
    }

    @Test
    @DisplayName("Plain JSON values map to symbols, lists and atoms")
    void plainValues() throws Exception {
        assertThat(decode("[\"f\", 1, 2.5, true, null]")).isEqualTo(read("(f 1 2.5 true nil)"));
    }

    @Test
    @DisplayName("Tagged objects map to strings, keywords, vectors, maps and markers")
    void taggedValues() throws Exception {
        Form form = decode("""
                {"vector": [{"str": "s"}, {"keyword": "k"}, {"gensym": "t"},
                            {"map": [[{"keyword": "a"}, 1]]}, {"quote": "x"}]}
                """);

        assertThat(form).isEqualTo(read("[\"s\" :k t# {:a 1} (quote x)]"));
    }

    @Test
    @DisplayName("Quasiquote annotations")
    void quasiquoteTags() throws Exception {
        Form form = decode("""
                {"syntax-quote": ["if", {"unquote": "test"}, null, ["do", {"unquote-splicing": "body"}]]}
                """);

        assertThat(form).isEqualTo(read("`(if ~test nil (do ~@body))"));
    }

    @Test
    @DisplayName("Encoding a template and decoding it again gives the same form")
    void encodeDecode() {
        Form template = read("`(let* [v# ~x] {:k \"s\" :n -3} (f ~@rest v#))");

        JsonNode encoded = FormCodec.encode(template);

        assertThat(FormCodec.decode(encoded)).isEqualTo(template);
        assertThat(FormCodec.encode(Atom.string("s")).toString()).isEqualTo("{\"str\":\"s\"}");
    }

    @Test
    @DisplayName("Errors name the JSON path")
    void errorsNamePath() {
        assertThatThrownBy(() -> decode("[\"f\", {\"wat\": 1}]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("$[1]")
                .hasMessageContaining("unknown form tag 'wat'");
        assertThatThrownBy(() -> decode("{\"str\": \"a\", \"keyword\": \"b\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exactly one key");
        assertThatThrownBy(() -> decode("{\"map\": [[1]]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[key, value] pair");
    }
}
