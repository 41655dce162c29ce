package com.sharedmodel.core.access;

import com.sharedmodel.core.domain.Address;
import com.sharedmodel.core.error.ErrorReason;
import com.sharedmodel.core.error.PermissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Single-holder capability. Mutating entry points call {@link #require(Address)} with the
 * identity of their caller; only the current holder may hand the capability on.
 */
public class OwnershipGate {

    private static final Logger log = LoggerFactory.getLogger(OwnershipGate.class);

    private final String name;
    private volatile Address holder;

    public OwnershipGate(String name, Address holder) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.holder = Objects.requireNonNull(holder, "Holder cannot be null");
    }

    public void require(Address caller) {
        if (!holder.equals(caller)) {
            throw new PermissionException(ErrorReason.UNAUTHORIZED,
                    "Caller " + caller + " is not the " + name + " holder");
        }
    }

    public synchronized void transfer(Address caller, Address newHolder) {
        Objects.requireNonNull(newHolder, "New holder cannot be null");
        require(caller);
        log.info("{} capability transferred from {} to {}", name, holder, newHolder);
        holder = newHolder;
    }

    public Address getHolder() { return holder; }

    public String getName() { return name; }
}
