package com.tazifor.popup.exception;

public class CampaignNotFoundException extends PopupEngineException {

    public CampaignNotFoundException(String campaignId) {
        super("Campaign not found: " + campaignId);
    }
}
