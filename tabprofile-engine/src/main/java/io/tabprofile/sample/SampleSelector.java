package io.tabprofile.sample;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.tabprofile.config.ProfilerConfig;
import io.tabprofile.model.Dataset;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.CombinationSampler;
import org.apache.commons.rng.simple.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Selects a subset of rows from a dataset for preview.
 *
 * <p>Random selection uses the XorShiro256++ generator from Apache Commons RNG. When the
 * configuration carries a sample seed every call with the same arguments returns the same rows;
 * otherwise each call draws a fresh seed.
 */
public final class SampleSelector {

    private static final Logger logger = LogManager.getLogger(SampleSelector.class);

    private final Long seed;

    public SampleSelector(ProfilerConfig config) {
        this.seed = Objects.requireNonNull(config, "config cannot be null").sampleSeed();
    }

    /// Selects up to `n` rows.
    ///
    /// @param dataset the dataset to sample
    /// @param n the number of rows wanted; all rows are returned when `n >= rowCount`
    /// @param mode how rows are picked
    /// @return the rows, each a list of raw values in column order, in dataset order
    /// @throws IllegalArgumentException if `n` is negative
    public List<List<Object>> select(Dataset dataset, int n, SampleMode mode) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
        if (n < 0) {
            throw new IllegalArgumentException("sample size must be non-negative, got " + n);
        }
        int rows = dataset.rowCount();
        int k = Math.min(n, rows);
        List<List<Object>> sample = new ArrayList<>(k);
        if (k == 0) {
            return sample;
        }
        if (mode == SampleMode.HEAD || k == rows) {
            for (int i = 0; i < k; i++) {
                sample.add(dataset.row(i));
            }
            return sample;
        }

        int[] indices = new CombinationSampler(newRandom(), rows, k).sample();
        Arrays.sort(indices);
        for (int index : indices) {
            sample.add(dataset.row(index));
        }
        logger.debug("Sampled {} of {} rows at random", k, rows);
        return sample;
    }

    private UniformRandomProvider newRandom() {
        return seed == null ? RandomSource.XO_SHI_RO_256_PP.create() : RandomSource.XO_SHI_RO_256_PP.create(seed);
    }
}
