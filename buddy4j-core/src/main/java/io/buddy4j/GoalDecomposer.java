package io.buddy4j;

import io.buddy4j.core.SubtaskDraft;

import java.util.List;

@FunctionalInterface
public interface GoalDecomposer {
    List<SubtaskDraft> decompose(String goal) throws Exception;
}
