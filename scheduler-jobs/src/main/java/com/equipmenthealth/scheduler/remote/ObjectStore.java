package com.equipmenthealth.scheduler.remote;

import com.equipmenthealth.scheduler.model.ObjectRef;

import java.io.InputStream;

/**
 * Read-only access to durable object storage.
 */
public interface ObjectStore {

    /**
     * Opens the object for reading. The caller closes the stream.
     *
     * @throws com.equipmenthealth.scheduler.error.TransportFailureException when the object cannot be read
     */
    InputStream getObject(ObjectRef ref);
}
