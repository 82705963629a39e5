package io.buddy4j;

/**
 * Maps request text to a handler name. Unknown names fall back to the configured default handler.
 */
@FunctionalInterface
public interface IntentClassifier {
    String classify(String query) throws Exception;
}
