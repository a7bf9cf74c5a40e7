package com.dcruver.notegraph.parse;

import lombok.Value;

/**
 * A single {@code key:: value} annotation on a page or block.
 * The key is already case-folded; the value is kept as written, minus surrounding whitespace.
 */
@Value
public class Property {
    String key;
    String rawKey;
    String value;
}
