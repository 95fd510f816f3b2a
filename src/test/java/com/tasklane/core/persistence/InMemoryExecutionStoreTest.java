package com.tasklane.core.persistence;

class InMemoryExecutionStoreTest extends ExecutionStoreContract {

    @Override
    protected ExecutionStore createStore() {
        return new InMemoryExecutionStore();
    }
}
