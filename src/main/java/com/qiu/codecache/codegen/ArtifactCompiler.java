package com.qiu.codecache.codegen;

/**
 * 缓存未命中时生成编译产物
 */
@FunctionalInterface
public interface ArtifactCompiler<T extends JitArtifact> {
    /**
     * 返回的产物引用计数为1，所有权交给调用方
     */
    T compile();
}
