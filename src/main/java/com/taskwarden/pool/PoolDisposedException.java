package com.taskwarden.pool;

public class PoolDisposedException extends PoolException {

    public PoolDisposedException(String poolName) {
        super(poolName + " is disposed");
    }
}
