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
package com.hellblazer.parallax.allknn;

import com.hellblazer.parallax.cache.RecordSerializer;
import com.hellblazer.parallax.engine.DualTreeConfig;
import com.hellblazer.parallax.engine.Gnp;
import com.hellblazer.parallax.engine.GrainSolver;

/**
 * All k nearest neighbors as a generalized N-body problem. {@code k} is read from the configuration parameter
 * {@value #K}, default 1.
 *
 * @author hal.hildebrand
 */
public class AllKnnGnp implements Gnp<KnnParam, KnnPoint, KnnStat, KnnResult, KnnGlobalResult> {
    public static final String K    = "k";
    public static final String NAME = "allknn";

    @Override
    public KnnParam createParam(DualTreeConfig config) {
        return new KnnParam(config.intParameter(K, 1));
    }

    @Override
    public KnnPoint createPoint(int dimension) {
        return new KnnPoint(dimension);
    }

    @Override
    public KnnResult createResult(KnnParam param) {
        return new KnnResult(param.k());
    }

    @Override
    public GrainSolver<KnnParam, KnnPoint, KnnStat, KnnResult, KnnGlobalResult> createSolver() {
        return new KnnSolver();
    }

    @Override
    public KnnStat createStat(KnnParam param) {
        return new KnnStat(param.dimension());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public KnnGlobalResult newGlobalResult() {
        return new KnnGlobalResult();
    }

    @Override
    public RecordSerializer<KnnParam> paramSerializer() {
        return KnnParam.SERIALIZER;
    }

    @Override
    public RecordSerializer<KnnPoint> pointSerializer(KnnParam param) {
        return KnnPoint.serializer(param.dimension());
    }

    @Override
    public RecordSerializer<KnnResult> resultSerializer(KnnParam param) {
        return KnnResult.serializer(param.k());
    }

    @Override
    public RecordSerializer<KnnStat> statSerializer(KnnParam param) {
        return KnnStat.serializer(param.dimension());
    }
}
