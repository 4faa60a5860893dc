package com.tazifor.popup.impression;

import com.tazifor.popup.model.ImpressionRecord;

/**
 * Ledger of shown popups, deduplicated by (campaignId, visitorId, triggerFireId).
 *
 * Throws {@link com.tazifor.popup.exception.TransientStoreException} when unreachable.
 */
public interface ImpressionStore {

    /**
     * @return true if this impression was new, false if it was already recorded
     */
    boolean recordIfAbsent(ImpressionRecord record);
}
