package lab.swapdesk.common;

public class SubmissionFailedException extends SwapException {

    public SubmissionFailedException(String message) {
        super(SwapErrorKind.SUBMISSION_FAILED, message);
    }

    public SubmissionFailedException(String message, Throwable cause) {
        super(SwapErrorKind.SUBMISSION_FAILED, message, cause);
    }
}
