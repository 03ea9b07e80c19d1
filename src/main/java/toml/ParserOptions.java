package toml;

import lombok.Builder;
import lombok.Value;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

@Value
@Builder
public class ParserOptions {

    /**
     * Label used in error messages, typically the file name.
     */
    String sourceName;

    @Builder.Default
    Charset charset = StandardCharsets.UTF_8;

    @Builder.Default
    ValueConverter converter = new DefaultValueConverter();

    public static ParserOptions defaults() {
        return ParserOptions.builder().build();
    }
}
