/**
 * Copyright (C) 2016, BMW AG
 * Author: Stefan Holder (stefan.holder@bmw.de)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.bmw.hmmfit;

import java.util.Arrays;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Lloyd's k-means with k-means++ seeding. Used to spread initial Gaussian means over the data.
 */
class KMeans {

    private static final int MAX_ITERATIONS = 100;

    private final int numClusters;

    KMeans(int numClusters) {
        if (numClusters <= 0) {
            throw new IllegalArgumentException("Number of clusters must be positive.");
        }
        this.numClusters = numClusters;
    }

    /**
     * Returns the cluster centers, one row per cluster.
     */
    double[][] fit(double[][] observations, RandomGenerator random) {
        final double[][] centers = seed(observations, random);
        final int[] assignments = new int[observations.length];
        Arrays.fill(assignments, -1);

        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            boolean changed = false;
            for (int t = 0; t < observations.length; t++) {
                final int nearest = nearest(centers, observations[t]);
                if (nearest != assignments[t]) {
                    assignments[t] = nearest;
                    changed = true;
                }
            }
            if (!changed) {
                break;
            }
            updateCenters(centers, observations, assignments);
        }
        return centers;
    }

    /**
     * k-means++: each further center is drawn with probability proportional to the squared
     * distance to the nearest center chosen so far.
     */
    private double[][] seed(double[][] observations, RandomGenerator random) {
        final int n = observations.length;
        final double[][] centers = new double[numClusters][];
        centers[0] = observations[random.nextInt(n)].clone();
        final double[] distances = new double[n];
        for (int c = 1; c < numClusters; c++) {
            double total = 0.0;
            for (int t = 0; t < n; t++) {
                distances[t] = squaredDistance(observations[t], centers[nearest(centers, c,
                        observations[t])]);
                total += distances[t];
            }
            if (total == 0.0) {
                // Fewer distinct observations than clusters.
                centers[c] = observations[random.nextInt(n)].clone();
                continue;
            }
            for (int t = 0; t < n; t++) {
                distances[t] /= total;
            }
            centers[c] = observations[Utils.sampleIndex(distances, random.nextDouble())].clone();
        }
        return centers;
    }

    private static void updateCenters(double[][] centers, double[][] observations,
            int[] assignments) {
        final int d = observations[0].length;
        final double[][] sums = new double[centers.length][d];
        final int[] counts = new int[centers.length];
        for (int t = 0; t < observations.length; t++) {
            counts[assignments[t]]++;
            for (int a = 0; a < d; a++) {
                sums[assignments[t]][a] += observations[t][a];
            }
        }
        for (int c = 0; c < centers.length; c++) {
            // Empty clusters keep their center.
            if (counts[c] > 0) {
                for (int a = 0; a < d; a++) {
                    centers[c][a] = sums[c][a] / counts[c];
                }
            }
        }
    }

    private static int nearest(double[][] centers, double[] x) {
        return nearest(centers, centers.length, x);
    }

    private static int nearest(double[][] centers, int numCenters, double[] x) {
        int result = 0;
        double best = Double.POSITIVE_INFINITY;
        for (int c = 0; c < numCenters; c++) {
            final double distance = squaredDistance(centers[c], x);
            if (distance < best) {
                best = distance;
                result = c;
            }
        }
        return result;
    }

    static double squaredDistance(double[] a, double[] b) {
        double result = 0.0;
        for (int i = 0; i < a.length; i++) {
            final double diff = a[i] - b[i];
            result += diff * diff;
        }
        return result;
    }

}
