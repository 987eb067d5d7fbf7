package com.example.paperdigest.model;

import java.util.List;

/**
 * A model response type that can check itself against its expected field constraints.
 */
public interface StructuredOutput {

    /**
     * @return human-readable constraint violations, empty when the payload is usable
     */
    List<String> violations();
}
