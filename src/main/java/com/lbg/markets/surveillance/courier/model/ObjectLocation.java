package com.lbg.markets.surveillance.courier.model;

import com.google.gson.JsonObject;

import java.util.Objects;

/**
 * Address of one object in a storage provider.
 *
 * @param provider storage provider
 * @param bucket   bucket or container name
 * @param key      object key inside the bucket
 * @param region   provider region, may be null
 */
public record ObjectLocation(CloudProvider provider, String bucket, String key, String region) {

    public ObjectLocation {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(key, "key");
    }

    public static ObjectLocation of(CloudProvider provider, String bucket, String key) {
        return new ObjectLocation(provider, bucket, key, null);
    }

    /**
     * Same bucket and region, different key.
     */
    public ObjectLocation withKey(String newKey) {
        return new ObjectLocation(provider, bucket, newKey, region);
    }

    JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("provider", provider.getWireName());
        json.addProperty("bucket", bucket);
        json.addProperty("key", key);
        if (region != null) {
            json.addProperty("region", region);
        }
        return json;
    }

    @Override
    public String toString() {
        return provider.getWireName() + "://" + bucket + "/" + key;
    }
}
