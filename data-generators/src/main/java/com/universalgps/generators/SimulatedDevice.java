package com.universalgps.generators;

import java.util.Random;

/**
 * Movement state of one simulated tracking unit.
 * Not thread-safe; each device is only ever advanced by one scheduled task at a time.
 */
class SimulatedDevice {

    // 55% driving, 25% parked, 20% idling
    private static final double DRIVING_PROBABILITY = 0.55;
    private static final double PARKED_PROBABILITY = 0.25;

    private final String imei;
    private double latitude;
    private double longitude;
    private double heading;
    private double speed;
    private double odometerKm;
    private double tripKm;
    private double fuelLevel;
    private int seqNo;
    private boolean driving;
    private boolean parked;

    SimulatedDevice(String imei, double latitude, double longitude, Random random) {
        this.imei = imei;
        this.latitude = latitude;
        this.longitude = longitude;
        this.heading = random.nextDouble() * 360;
        this.odometerKm = 10000 + random.nextDouble() * 100000;
        this.fuelLevel = 40 + random.nextDouble() * 60;
    }

    /**
     * Move the device forward by one reporting interval.
     */
    void advance(Random random, double intervalSeconds) {
        double rand = random.nextDouble();
        driving = rand < DRIVING_PROBABILITY;
        parked = !driving && rand < DRIVING_PROBABILITY + PARKED_PROBABILITY;

        if (driving) {
            // 30-60 km/h in town, 80-120 km/h on the highway
            speed = random.nextDouble() < 0.5
                ? 30 + random.nextDouble() * 30
                : 80 + random.nextDouble() * 40;
            move(random, intervalSeconds);
        } else {
            speed = 0;
            tripKm = parked ? 0 : tripKm;
        }

        if (speed > 0) {
            fuelLevel = Math.max(5, fuelLevel - 0.05 - speed * 0.0005);
        } else if (fuelLevel < 10 && parked) {
            fuelLevel = 80 + random.nextDouble() * 20;
        }
        seqNo = (seqNo + 1) & 0xFFFF;
    }

    private void move(Random random, double intervalSeconds) {
        double distanceKm = speed * (intervalSeconds / 3600.0);
        double headingRad = Math.toRadians(heading);

        // Approximate: 1 degree latitude = 111 km
        latitude += (distanceKm * Math.cos(headingRad)) / 111.0;
        longitude += (distanceKm * Math.sin(headingRad)) / (111.0 * Math.cos(Math.toRadians(latitude)));
        latitude = Math.max(-89.9, Math.min(89.9, latitude));
        longitude = Math.max(-179.9, Math.min(179.9, longitude));

        odometerKm += distanceKm;
        tripKm += distanceKm;

        if (random.nextDouble() < 0.2) {
            heading = (heading + (random.nextDouble() * 60 - 30) + 360) % 360;
        }
    }

    String imei() {
        return imei;
    }

    double latitude() {
        return latitude;
    }

    double longitude() {
        return longitude;
    }

    double heading() {
        return heading;
    }

    double speed() {
        return speed;
    }

    int odometerMeters() {
        return (int) Math.round(odometerKm * 1000);
    }

    int tripMeters() {
        return (int) Math.round(tripKm * 1000);
    }

    double fuelLevel() {
        return fuelLevel;
    }

    int seqNo() {
        return seqNo;
    }

    boolean driving() {
        return driving;
    }

    boolean parked() {
        return parked;
    }
}
