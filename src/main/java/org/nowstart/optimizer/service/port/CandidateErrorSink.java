package org.nowstart.optimizer.service.port;

import java.util.Map;

public interface CandidateErrorSink {

    void track(Exception exception, String operation, Map<String, Object> context);
}
