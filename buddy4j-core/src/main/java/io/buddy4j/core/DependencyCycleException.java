package io.buddy4j.core;

import java.util.List;

public class DependencyCycleException extends TaskValidationException {

    public DependencyCycleException(List<String> errors) {
        super(errors);
    }
}
