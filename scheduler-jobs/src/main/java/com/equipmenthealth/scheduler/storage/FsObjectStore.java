package com.equipmenthealth.scheduler.storage;

import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.TransportFailureException;
import com.equipmenthealth.scheduler.model.ObjectRef;
import com.equipmenthealth.scheduler.remote.ObjectStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Object store over a local directory: {@code <root>/<bucket>/<key>}.
 */
public final class FsObjectStore implements ObjectStore {
    private final Path root;

    public FsObjectStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public InputStream getObject(ObjectRef ref) {
        Path path = root.resolve(ref.bucket()).resolve(ref.key()).normalize();
        if (!path.startsWith(root)) {
            throw new TransportFailureException("GetObject", ErrorContext.object(ref.key()),
                    new AccessDeniedException(path.toString(), null, "object key escapes the store root"));
        }
        try {
            return Files.newInputStream(path);
        } catch (IOException ex) {
            throw new TransportFailureException("GetObject", ErrorContext.object(ref.key()), ex);
        }
    }
}
