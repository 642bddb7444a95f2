package com.equipmenthealth.scheduler.model;

import java.util.Objects;

/**
 * Bucket and key of one stored object.
 */
public final class ObjectRef {
    private final String bucket;
    private final String key;

    public ObjectRef(String bucket, String key) {
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.key = Objects.requireNonNull(key, "key");
    }

    public String bucket() {
        return bucket;
    }

    public String key() {
        return key;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ObjectRef)) {
            return false;
        }
        ObjectRef that = (ObjectRef) other;
        return bucket.equals(that.bucket) && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucket, key);
    }

    @Override
    public String toString() {
        return "s3://" + bucket + "/" + key;
    }
}
