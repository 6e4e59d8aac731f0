package com.hlsflow.translator;

/**
 * 翻译失败的分类。所有类别都终止当前翻译请求。
 */
public enum ErrorCategory {
    /** 源码无法解析，或引用了未声明的名字 */
    PARSE,
    /** 语言子集之外的构造 */
    UNSUPPORTED,
    /** 无序求值中的读写冲突 */
    SEQUENCING,
    /** 无法静态展开的控制流 */
    CONTROL_FLOW,
    /** 通道使用方式不合法 */
    CHANNEL_USAGE,
    /** 结构体布局错误 */
    LAYOUT,
    /** 找不到顶层入口或通道 */
    NOT_FOUND
}
