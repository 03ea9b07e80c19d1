package toml;

import lombok.Value;

@Value
public class Dimensions {
    int depth;
    int length;
}
