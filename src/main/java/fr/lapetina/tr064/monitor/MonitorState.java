package fr.lapetina.tr064.monitor;

/**
 * Lifecycle of a {@link CallMonitor}.
 */
public enum MonitorState {
    IDLE,
    CONNECTING,
    LISTENING,
    RECONNECTING,
    STOPPED
}
