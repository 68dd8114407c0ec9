package com.trade.paper.book;

/**
 * 增量应用结果
 * 断档不抛异常，调用方据此重新拉取快照
 */
public enum DiffOutcome {
    APPLIED,   // 已合并，lastUpdateId 前移
    STALE,     // u <= lastUpdateId，已包含在快照中，丢弃
    BUFFERED,  // 尚无快照（首次加载或重同步中），暂存等待回放
    GAP        // 序号断档，已丢弃当前盘口，需要重新拉取快照
}
