package com.templatebinder.store;

import java.util.List;

public record StoreComposition(String name, int width, int height, int duration, int frameRate,
                               List<StoreLayer> layers) {

    public StoreComposition {
        layers = List.copyOf(layers);
    }
}
