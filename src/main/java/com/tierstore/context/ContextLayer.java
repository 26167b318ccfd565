package com.tierstore.context;

public enum ContextLayer {
    L0(0),
    L1(1),
    L2(2);

    private final int level;

    ContextLayer(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static ContextLayer ofLevel(long level) {
        for (ContextLayer layer : values()) {
            if (layer.level == level) {
                return layer;
            }
        }
        throw new IllegalArgumentException("unknown context level " + level);
    }
}
