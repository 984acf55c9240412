package com.stockscan.cn.runner;

/**
 * Run-level precondition failure: the data directory is missing or holds no instrument files.
 */
public class BatchInputException extends Exception {

    public BatchInputException(String message) {
        super(message);
    }

    public BatchInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
