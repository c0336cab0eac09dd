package io.flowkube.kubernetes.runners;

public interface RunnableOperation<T extends Output> {
    T run(RunContext runContext) throws Exception;
}
