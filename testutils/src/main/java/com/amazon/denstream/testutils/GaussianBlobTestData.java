/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.denstream.testutils;

import java.util.Random;

/**
 * This class samples points from a mixture of multi-variate normal
 * distributions with covariance matrices of the form sigma * I, one per blob
 * center. Rows arrive one per time unit; the blob of each row is chosen
 * uniformly at random. Optionally the centers drift linearly with time, which
 * makes old summaries stale.
 */
public class GaussianBlobTestData {

    private final double[][] centers;
    private final double sigma;
    private final double[] drift;

    public GaussianBlobTestData(double[][] centers, double sigma, double[] drift) {
        if (centers.length == 0) {
            throw new IllegalArgumentException("need at least one center");
        }
        this.centers = centers;
        this.sigma = sigma;
        this.drift = drift;
    }

    public GaussianBlobTestData(double[][] centers, double sigma) {
        this(centers, sigma, new double[centers[0].length]);
    }

    /**
     * three well separated blobs in the plane
     */
    public GaussianBlobTestData() {
        this(new double[][] { { 0, 0 }, { 1000, 0 }, { 0, 1000 } }, 3.0);
    }

    public LabeledStreamData generateTestData(int numberOfRows) {
        return generateTestData(numberOfRows, 0, 0);
    }

    public LabeledStreamData generateTestData(int numberOfRows, long startTime, int seed) {
        double[][] data = new double[numberOfRows][];
        int[] labels = new int[numberOfRows];
        long[] timeStamps = new long[numberOfRows];

        Random rng = (seed != 0) ? new Random(seed) : new Random();
        NormalDistribution dist = new NormalDistribution(rng);

        for (int i = 0; i < numberOfRows; i++) {
            int blob = rng.nextInt(centers.length);
            labels[i] = blob;
            timeStamps[i] = startTime + i;
            data[i] = new double[centers[blob].length];
            for (int j = 0; j < data[i].length; j++) {
                double mu = centers[blob][j] + drift[j] * i;
                data[i][j] = dist.nextDouble(mu, sigma);
            }
        }
        return new LabeledStreamData(data, labels, timeStamps);
    }

    public int getNumberOfBlobs() {
        return centers.length;
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
