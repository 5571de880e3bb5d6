package com.qiu.codecache.codegen;

/**
 * 持有编译生成代码所占用的资源，产物销毁时关闭一次
 */
public interface CodeOwner extends AutoCloseable {
    @Override
    void close();
}
