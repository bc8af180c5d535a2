package com.launchradar.ingestion.adapter;

import com.launchradar.domain.ChainId;

import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * A live JSON-RPC socket to one chain. Received text frames are put on the attached queue; the next frame is
 * requested only after the previous one was enqueued.
 */
public interface SocketConnection {

    int NORMAL_CLOSURE = 1000;
    int ABNORMAL_CLOSURE = 1006;

    ChainId chain();

    SocketState state();

    /**
     * Frames received before a queue is attached are discarded.
     */
    void attachFrameQueue(BlockingQueue<String> queue);

    void addCloseListener(SocketCloseListener listener);

    /**
     * Sends {@code eth_subscribe ["logs", {address, topics: [eventTopics]}]}. The subscription id arrives as a
     * regular frame.
     */
    void subscribeLogs(String contractAddress, List<String> eventTopics);

    void close(int code, String reason);
}
