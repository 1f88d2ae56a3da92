package org.carball.lbs.model.example;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A search hit. Distance is {@code 1 - cosine similarity}; smaller is closer.
 */
public record ExampleMatch(@JsonIgnoreProperties("embedding") QueryExample example, double distance) {

    public double similarity() {
        return 1.0 - distance;
    }
}
