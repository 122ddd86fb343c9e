package com.memorybox.retrieval;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface CorpusOpener {
    /**
     * @param rawSource when not null, the corpus content is (re)imported from this file
     */
    CorpusProvider open(String corpusId, Path rawSource) throws IOException;
}
