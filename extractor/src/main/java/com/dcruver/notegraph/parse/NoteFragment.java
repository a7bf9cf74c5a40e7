package com.dcruver.notegraph.parse;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything extracted from one note file, computed without any knowledge of other notes.
 * Page names are still raw spellings; identity resolution happens during assembly.
 */
@Value
@Builder
public class NoteFragment {
    String relativePath;
    String pageName;

    List<Property> pageProperties;
    List<String> pageTags;
    boolean pagePublic;

    List<BlockFragment> blocks;
}
