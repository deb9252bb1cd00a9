package lab.swapdesk.orchestration.policy;

public record RuleDecision(
        boolean allowed,
        String reason
) {
    public static RuleDecision allow() {
        return new RuleDecision(true, "ALLOWED");
    }

    public static RuleDecision reject(String reason) {
        return new RuleDecision(false, reason);
    }
}
