package com.platform.datakeeper.data;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Access to the data archive. The engine only addresses units by path, channel
 * range and sample range; the on-disk format belongs to the implementation.
 */
public interface DataStoreAdapter {
    
    /**
     * Lists candidate units under the given roots. Missing roots yield nothing.
     */
    List<DataUnit> discover(Collection<String> roots) throws IOException;
    
    /**
     * Current metadata of the unit at {@code path}, empty if it no longer exists.
     */
    Optional<DataUnit> find(String path) throws IOException;
    
    SampleMatrix read(DataUnit unit) throws IOException;
    
    /**
     * Writes a derived unit.
     *
     * @param suffix name suffix of the new unit when written alongside the source
     * @param attributes attributes merged over the source's for the new unit
     * @param replace atomically replace the source instead of writing alongside
     * @return the written unit
     */
    DataUnit write(DataUnit source, String suffix, SampleMatrix data,
                   Map<String, Object> attributes, boolean replace) throws IOException;
    
    void delete(DataUnit unit) throws IOException;
    
    /**
     * Current size in bytes, 0 if the unit no longer exists.
     */
    long sizeOf(DataUnit unit) throws IOException;
}
