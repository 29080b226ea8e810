package com.fsnow.indexadvisor.output;

import com.fsnow.indexadvisor.model.IndexCandidate;

import java.util.List;

/**
 * Receives the ranked recommendations of a run for presentation or storage.
 */
public interface ResultSink {
    
    void publish(List<IndexCandidate> recommendations);
}
