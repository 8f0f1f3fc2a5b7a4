package fr.lapetina.loadsim.domain.model;

/**
 * Why the admission queue turned a work item away.
 */
public enum RejectionReason {
    /** Origin address is on the blocklist */
    BLOCKED_ORIGIN("Origin address is blocked"),

    /** Queue holds as many items as its capacity allows */
    QUEUE_FULL("Admission queue is full");

    private final String message;

    RejectionReason(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
