package net.gantry.core.service;

import net.gantry.core.model.Resource;
import net.gantry.core.spi.Clock;
import net.gantry.core.spi.ResourceRepository;
import net.gantry.core.spi.TxRunner;

import java.util.List;
import java.util.NoSuchElementException;

/** 용량 인벤토리: 시드, 관측 반영, 사용률 */
public final class ResourceService {
    private final ResourceRepository resources;
    private final TxRunner tx;
    private final Clock clock;

    public ResourceService(ResourceRepository resources, TxRunner tx, Clock clock) {
        this.resources = resources;
        this.tx = tx;
        this.clock = clock;
    }

    public void register(int index, String name, long totalCapacity, long freeCapacity) throws Exception {
        if (index < 0) throw new IllegalArgumentException("resource index must be >= 0");
        if (totalCapacity < 0 || freeCapacity < 0 || freeCapacity > totalCapacity) {
            throw new IllegalArgumentException("require 0 <= free <= total for resource " + index);
        }
        tx.required(() -> {
            resources.upsert(new Resource(index, name, totalCapacity, freeCapacity, clock.now()));
            return null;
        });
    }

    /** 관측된 가용량 반영 (총량을 넘으면 총량으로 자른다) */
    public Resource observe(int index, long freeCapacity) throws Exception {
        if (freeCapacity < 0) throw new IllegalArgumentException("free_capacity must be >= 0");
        return tx.required(() -> {
            Resource r = resources.findByIndex(index)
                    .orElseThrow(() -> new NoSuchElementException("resource not found: " + index));
            long free = Math.min(freeCapacity, r.totalCapacity());
            resources.updateFree(index, free, clock.now());
            return resources.findByIndex(index).orElseThrow();
        });
    }

    public List<Resource> list() throws Exception {
        return tx.required(resources::findAll);
    }

    /** 사용률(%) = 100 * (Σtotal - Σfree) / Σtotal, 자원 없으면 0 */
    static double utilization(List<Resource> all) {
        long total = 0, used = 0;
        for (Resource r : all) {
            total += r.totalCapacity();
            used += r.usedCapacity();
        }
        return total == 0 ? 0.0 : 100.0 * used / total;
    }
}
