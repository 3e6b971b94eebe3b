package com.ziplens.service.cache;

public record SweepResult(int expiredRemoved, int corruptRemoved) {
    public int total() {
        return expiredRemoved + corruptRemoved;
    }
}
