package com.fsnow.indexadvisor.integration;

import com.mongodb.MongoException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;

/**
 * Tells apart driver failures that mean the server is gone from failures of a single operation.
 */
final class MongoFailures {
    
    private MongoFailures() {}
    
    /**
     * True for failures no retry of the same operation can fix: no server could be selected,
     * the connection broke, or authentication was refused.
     */
    static boolean isUnavailable(MongoException e) {
        return e instanceof MongoTimeoutException
                || e instanceof MongoSocketException
                || e instanceof MongoSecurityException;
    }
}
