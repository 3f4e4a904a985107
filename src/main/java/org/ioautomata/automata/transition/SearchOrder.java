package org.ioautomata.automata.transition;

/**
 * 状态空间搜索的遍历顺序。
 */
public enum SearchOrder {

    /**
     * 先进先出，状态按与初始状态的距离非递减的顺序被发现
     */
    BREADTH_FIRST,
    /**
     * 后进先出
     */
    DEPTH_FIRST
}
