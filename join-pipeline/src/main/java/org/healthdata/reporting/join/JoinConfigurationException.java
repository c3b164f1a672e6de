package org.healthdata.reporting.join;

import org.healthdata.reporting.common.ErrorCode;
import org.healthdata.reporting.common.ReportingException;

/** A join request that cannot run as configured. Always raised before any source is fetched. */
public class JoinConfigurationException extends ReportingException {
    public JoinConfigurationException(ErrorCode code, String message) {
        super(code, message);
    }
}
