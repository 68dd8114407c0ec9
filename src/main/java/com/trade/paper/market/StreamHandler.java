package com.trade.paper.market;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 单个流的消息回调，参数为组合流信封中的 data
 */
@FunctionalInterface
public interface StreamHandler {

    void onMessage(JsonNode data);
}
