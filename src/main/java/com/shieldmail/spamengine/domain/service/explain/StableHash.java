package com.shieldmail.spamengine.domain.service.explain;

public final class StableHash {

    private StableHash() {
    }

    public static long of(String s) {
        int h = 0;
        for (int i = 0; i < s.length(); i++) {
            h = ((h << 5) - h) + s.charAt(i);
        }
        return Math.abs((long) h);
    }
}
