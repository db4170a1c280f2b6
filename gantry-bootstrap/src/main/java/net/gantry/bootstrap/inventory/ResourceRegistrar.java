package net.gantry.bootstrap.inventory;

import net.gantry.bootstrap.props.GantryProperties;
import net.gantry.core.service.ResourceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** 설정의 자원 목록을 인벤토리에 올린다 (index 기준 upsert) */
public class ResourceRegistrar {
    private static final Logger log = LoggerFactory.getLogger(ResourceRegistrar.class);

    private final ResourceService resources;

    public ResourceRegistrar(ResourceService resources) {
        this.resources = resources;
    }

    public void register(List<GantryProperties.ResourceDef> defs) throws Exception {
        Set<Integer> seen = new HashSet<>();
        for (var d : defs) {
            if (!seen.add(d.getIndex())) {
                throw new IllegalArgumentException("duplicate resource index: " + d.getIndex());
            }
            String name = d.getName() != null ? d.getName() : "gpu-" + d.getIndex();
            long free = d.getFreeCapacity() != null ? d.getFreeCapacity() : d.getTotalCapacity();
            resources.register(d.getIndex(), name, d.getTotalCapacity(), free);
            log.info("Resource registered: index={} name='{}' total={} free={}",
                    d.getIndex(), name, d.getTotalCapacity(), free);
        }
    }
}
