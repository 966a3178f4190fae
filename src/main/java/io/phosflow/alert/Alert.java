package io.phosflow.alert;

/**
 * Human-visible notification.
 *
 * @param unitId unit the alert is about, {@code null} for controller-wide alerts
 */
public record Alert(String title, String body, String unitId) {
    public static Alert forUnit(String unitId, String title, String body) {
        return new Alert(title, body, unitId);
    }
}
