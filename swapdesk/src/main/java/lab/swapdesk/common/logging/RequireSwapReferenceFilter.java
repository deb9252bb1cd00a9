package lab.swapdesk.common.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

import java.util.Map;

/**
 * Allows only logs emitted while a swap or withdrawal was running (MDC swapRef present).
 * Used for the swap audit appender.
 */
public class RequireSwapReferenceFilter extends Filter<ILoggingEvent> {

    private static final String SWAP_REF_KEY = "swapRef";

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (event == null) {
            return FilterReply.DENY;
        }
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null && mdc.containsKey(SWAP_REF_KEY)) {
            return FilterReply.NEUTRAL;
        }
        return FilterReply.DENY;
    }
}
