package com.retryguard.core.spi;

import com.retryguard.core.event.StrategyEvent;

/**
 * 策略事件监听 SPI
 * <p>
 * 在调用线程上同步回调（已释放实体锁），实现应尽量轻量
 */
public interface StrategyEventListener {

    /** 监听器名称 */
    default String name() {
        return getClass().getSimpleName();
    }

    /** 是否关心该事件 */
    default boolean supports(StrategyEvent event) {
        return true;
    }

    void onEvent(StrategyEvent event);
}
