package ch.sbb.pulse.notification;

public enum NotificationKind {
    ALERT,
    RECOVERY
}
