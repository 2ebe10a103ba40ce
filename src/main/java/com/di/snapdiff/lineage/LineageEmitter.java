package com.di.snapdiff.lineage;

public interface LineageEmitter {

    void emit(LineageEvent event);
}
