/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Parallax.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.parallax.engine.rpc;

import com.google.protobuf.ByteString;
import com.hellblazer.parallax.cache.BlockDevice;
import com.hellblazer.parallax.cache.RecordSerializer;
import com.hellblazer.parallax.engine.DualTreeException;
import com.hellblazer.parallax.engine.rpc.proto.*;
import com.hellblazer.parallax.engine.work.RemoteWorkQueueBackend;
import com.hellblazer.parallax.engine.work.WorkQueue;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * The RPC context of one rank: its server, publishing objects on channels for the other ranks, and its channels to
 * every rank's server, its own included.
 *
 * <p>Calls wait for the target rank's server to come up. They have no deadline unless one is given, so a lost peer
 * stalls the caller. Failed calls surface as {@link DualTreeException} naming the method, channel and peer.
 *
 * @author hal.hildebrand
 */
public class Rpc implements AutoCloseable {
    public static final int MASTER_RANK = 0;

    private static final Logger log = LoggerFactory.getLogger(Rpc.class);

    private final Duration                                        deadline;
    private final RankDirectory                                   directory;
    private final ExecutorService                                 executor;
    private final int                                             rank;
    private final ChannelRegistry                                 registry = new ChannelRegistry();
    private       ManagedChannel[]                                channels;
    private       boolean                                         closed;
    private       Server                                          server;
    private       DualTreeServiceGrpc.DualTreeServiceBlockingStub[] stubs;

    /**
     * @param directory the ranks of the run
     * @param rank      this process's rank
     * @param deadline  deadline applied to each call, or null to wait indefinitely
     */
    public Rpc(RankDirectory directory, int rank, Duration deadline) {
        this.directory = Objects.requireNonNull(directory, "Directory cannot be null");
        this.rank = Objects.checkIndex(rank, directory.size());
        this.deadline = deadline;
        var threads = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            var thread = new Thread(r, "rpc-" + rank + "-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void barrier(int channel) {
        log.debug("Rank {} entering barrier {}", rank, channel);
        var request = BarrierRequest.newBuilder().setChannel(channel).setRank(rank).build();
        call("Barrier", channel, MASTER_RANK, () -> stub(MASTER_RANK).barrier(request));
        log.debug("Rank {} passed barrier {}", rank, channel);
    }

    /**
     * Shut down the server and close the channels. Does not wait for the other ranks, see {@link #done()}.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (server != null) {
            server.shutdown();
        }
        if (channels != null) {
            for (var channel : channels) {
                channel.shutdown();
            }
        }
        try {
            if (server != null && !server.awaitTermination(5, TimeUnit.SECONDS)) {
                server.shutdownNow();
            }
            if (channels != null) {
                for (var channel : channels) {
                    if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                        channel.shutdownNow();
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            executor.shutdownNow();
        }
        log.debug("Rank {} RPC closed", rank);
    }

    public ArrayDescription describeArray(int channel, int owner) {
        var request = ArrayRequest.newBuilder().setChannel(channel).build();
        return call("DescribeArray", channel, owner, () -> stub(owner).describeArray(request));
    }

    /**
     * Wait until every rank is done with RPC, then shut down
     */
    public void done() {
        barrier(Channels.SHUTDOWN_BARRIER);
        close();
        log.info("Rank {} of {} done", rank, nRanks());
    }

    public <T> T getRemoteData(int channel, int owner, RecordSerializer<T> serializer) {
        var request = DataRequest.newBuilder().setChannel(channel).setRank(rank).build();
        var reply = call("FetchData", channel, owner, () -> stub(owner).fetchData(request));
        return serializer.fromBytes(reply.getPayload().toByteArray());
    }

    public List<Integer> getRemoteWork(int channel, int owner) {
        var request = WorkRequest.newBuilder().setChannel(channel).setRank(rank).build();
        return call("GetWork", channel, owner, () -> stub(owner).getWork(request)).getGrainsList();
    }

    public boolean isMaster() {
        return rank == MASTER_RANK;
    }

    public int nRanks() {
        return directory.size();
    }

    public int rank() {
        return rank;
    }

    public byte[] readBlock(int channel, int owner, int blockId) {
        var request = BlockRequest.newBuilder().setChannel(channel).setBlockId(blockId).build();
        return call("ReadBlock", channel, owner, () -> stub(owner).readBlock(request)).getRecords().toByteArray();
    }

    /**
     * Publish the blocks of a device on the channel
     */
    public void registerArray(int channel, BlockDevice device) {
        registry.registerArray(channel, device);
        log.debug("Rank {} published array on channel {}", rank, channel);
    }

    /**
     * Publish a snapshot of the value on the channel
     */
    public <T> void registerData(int channel, RecordSerializer<T> serializer, T value) {
        registry.registerData(channel, new DataGetterBackend<>(serializer, value));
        log.debug("Rank {} published data on channel {}", rank, channel);
    }

    /**
     * Publish the queue on the channel. The queue may still be used locally.
     */
    public void registerWork(int channel, WorkQueue queue) {
        registry.registerWork(channel, new RemoteWorkQueueBackend(queue));
        log.debug("Rank {} published work queue on channel {}", rank, channel);
    }

    /**
     * Start this rank's server and open channels to every rank
     */
    public synchronized Rpc start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Rank " + rank + " RPC already started");
        }
        server = directory.serverFor(rank)
                          .executor(executor)
                          .addService(new DualTreeServer(nRanks(), registry, executor))
                          .build()
                          .start();
        channels = new ManagedChannel[nRanks()];
        stubs = new DualTreeServiceGrpc.DualTreeServiceBlockingStub[nRanks()];
        for (int r = 0; r < nRanks(); r++) {
            channels[r] = directory.channelTo(r);
            stubs[r] = DualTreeServiceGrpc.newBlockingStub(channels[r]);
        }
        log.info("Rank {} of {} started", rank, nRanks());
        return this;
    }

    public void writeRecords(int channel, int owner, int blockId, int begin, int end, byte[] records) {
        var request = RecordWrite.newBuilder()
                                 .setChannel(channel)
                                 .setBlockId(blockId)
                                 .setBegin(begin)
                                 .setEnd(end)
                                 .setRecords(ByteString.copyFrom(records))
                                 .build();
        call("WriteRecords", channel, owner, () -> stub(owner).writeRecords(request));
    }

    private <R> R call(String method, int channel, int owner, Supplier<R> invocation) {
        try {
            return invocation.get();
        } catch (StatusRuntimeException e) {
            throw new DualTreeException(
            String.format("%s on channel %d from rank %d to rank %d failed: %s", method, channel, rank, owner,
                          e.getStatus()), e);
        }
    }

    private DualTreeServiceGrpc.DualTreeServiceBlockingStub stub(int owner) {
        if (stubs == null) {
            throw new IllegalStateException("Rank " + rank + " RPC not started");
        }
        var stub = stubs[Objects.checkIndex(owner, stubs.length)].withWaitForReady();
        if (deadline != null) {
            stub = stub.withDeadlineAfter(deadline.toMillis(), TimeUnit.MILLISECONDS);
        }
        return stub;
    }
}
