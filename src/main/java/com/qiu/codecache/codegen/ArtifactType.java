package com.qiu.codecache.codegen;

/**
 * 编译产物类型，tag 写在每个键的最前面，不同类型的键不会互相冲突
 */
public enum ArtifactType {
    ROW_PROJECTOR(1);

    private final int tag;

    ArtifactType(int tag) {
        this.tag = tag;
    }

    public int getTag() {
        return tag;
    }
}
