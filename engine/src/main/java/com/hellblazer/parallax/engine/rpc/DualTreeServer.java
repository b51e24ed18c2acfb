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
import com.hellblazer.parallax.cache.CacheException;
import com.hellblazer.parallax.engine.rpc.proto.*;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Server side of {@link Rpc}: answers requests from the objects registered in a {@link ChannelRegistry} and hosts
 * the counting barriers.
 *
 * <p>No request blocks a server thread. Requests for channels not yet registered complete once the owner registers,
 * and barrier replies are sent when the last rank arrives.
 *
 * @author hal.hildebrand
 */
class DualTreeServer extends DualTreeServiceGrpc.DualTreeServiceImplBase {
    private static final Logger log = LoggerFactory.getLogger(DualTreeServer.class);

    private final ConcurrentHashMap<Integer, Barrier> barriers = new ConcurrentHashMap<>();
    private final Executor                            executor;
    private final int                                 nRanks;
    private final ChannelRegistry                     registry;

    DualTreeServer(int nRanks, ChannelRegistry registry, Executor executor) {
        this.nRanks = nRanks;
        this.registry = registry;
        this.executor = executor;
    }

    @Override
    public void barrier(BarrierRequest request, StreamObserver<BarrierReply> responseObserver) {
        var channel = request.getChannel();
        List<StreamObserver<BarrierReply>> released;
        var barrier = barriers.computeIfAbsent(channel, c -> new Barrier());
        synchronized (barrier) {
            if (!barrier.ranks.add(request.getRank())) {
                responseObserver.onError(Status.FAILED_PRECONDITION.withDescription(
                "Rank " + request.getRank() + " arrived twice at barrier " + channel).asRuntimeException());
                return;
            }
            barrier.waiting.add(responseObserver);
            log.debug("Rank {} arrived at barrier {} ({}/{})", request.getRank(), channel, barrier.ranks.size(),
                      nRanks);
            if (barrier.ranks.size() < nRanks) {
                return;
            }
            barriers.remove(channel, barrier);
            released = new ArrayList<>(barrier.waiting);
        }
        var reply = BarrierReply.newBuilder().setChannel(channel).setArrived(nRanks).build();
        for (var waiting : released) {
            waiting.onNext(reply);
            waiting.onCompleted();
        }
    }

    @Override
    public void describeArray(ArrayRequest request, StreamObserver<ArrayDescription> responseObserver) {
        var channel = request.getChannel();
        respond(registry.array(channel), device -> ArrayDescription.newBuilder()
                                                                   .setChannel(channel)
                                                                   .setSize(device.size())
                                                                   .setBlockElems(device.blockElems())
                                                                   .setRecordSize(device.recordSize())
                                                                   .setDefaultRecord(
                                                                   ByteString.copyFrom(device.defaultRecord()))
                                                                   .setFixed(device.isFixed())
                                                                   .build(), responseObserver);
    }

    @Override
    public void fetchData(DataRequest request, StreamObserver<DataReply> responseObserver) {
        var channel = request.getChannel();
        respond(registry.data(channel), backend -> DataReply.newBuilder()
                                                            .setChannel(channel)
                                                            .setPayload(ByteString.copyFrom(backend.payload()))
                                                            .build(), responseObserver);
    }

    @Override
    public void getWork(WorkRequest request, StreamObserver<WorkReply> responseObserver) {
        var channel = request.getChannel();
        respond(registry.work(channel), backend -> WorkReply.newBuilder()
                                                            .setChannel(channel)
                                                            .addAllGrains(backend.getWork(request.getRank()))
                                                            .build(), responseObserver);
    }

    @Override
    public void readBlock(BlockRequest request, StreamObserver<BlockData> responseObserver) {
        var channel = request.getChannel();
        respond(registry.array(channel), device -> BlockData.newBuilder()
                                                            .setChannel(channel)
                                                            .setBlockId(request.getBlockId())
                                                            .setRecords(ByteString.copyFrom(
                                                            device.readBlock(request.getBlockId())))
                                                            .build(), responseObserver);
    }

    @Override
    public void writeRecords(RecordWrite request, StreamObserver<WriteAck> responseObserver) {
        var channel = request.getChannel();
        respond(registry.array(channel), device -> {
            device.writeRecords(request.getBlockId(), request.getBegin(), request.getEnd(),
                                request.getRecords().toByteArray());
            return WriteAck.newBuilder().setChannel(channel).setWritten(request.getEnd() - request.getBegin()).build();
        }, responseObserver);
    }

    private Status statusOf(Throwable error) {
        if (error instanceof IndexOutOfBoundsException || error instanceof IllegalArgumentException) {
            return Status.INVALID_ARGUMENT;
        }
        if (error instanceof IllegalStateException) {
            return Status.FAILED_PRECONDITION;
        }
        if (error instanceof UnsupportedOperationException) {
            return Status.UNIMPLEMENTED;
        }
        if (error instanceof CacheException) {
            return Status.UNAVAILABLE;
        }
        return Status.INTERNAL;
    }

    private <B, R> void respond(CompletableFuture<B> backend, Function<B, R> handler, StreamObserver<R> observer) {
        backend.thenApplyAsync(handler, executor).whenComplete((reply, error) -> {
            if (error == null) {
                observer.onNext(reply);
                observer.onCompleted();
                return;
            }
            var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            log.warn("Request failed: {}", cause.toString());
            observer.onError(statusOf(cause).withDescription(cause.getMessage()).withCause(cause).asRuntimeException());
        });
    }

    private static final class Barrier {
        private final Set<Integer>                       ranks   = new HashSet<>();
        private final List<StreamObserver<BarrierReply>> waiting = new ArrayList<>();
    }
}
