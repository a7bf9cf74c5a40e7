package com.dcruver.notegraph.identity;

import lombok.Data;

@Data
public class ResourceEntry {
    private final String path;
    private boolean asset;
}
