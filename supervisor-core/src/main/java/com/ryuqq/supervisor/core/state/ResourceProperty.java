package com.ryuqq.supervisor.core.state;

/**
 * 변경 알림 대상이 되는 관찰 가능한 속성.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public enum ResourceProperty {
    STATE,
    ALIVE,
    CAN_OPERATE,
    STATE_MESSAGE,
    HANDLE,
    MAIN_WINDOW_HANDLE
}
