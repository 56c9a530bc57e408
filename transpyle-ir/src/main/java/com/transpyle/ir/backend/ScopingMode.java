package com.transpyle.ir.backend;

/**
 * 已声明变量的跟踪方式
 */
public enum ScopingMode {
    /** 每个 if 分支、while 与 for 循环体各自一层作用域，循环变量属于循环体 */
    BLOCK,
    /** 整个生成过程共用一个集合，循环变量全局登记 */
    FLAT
}
