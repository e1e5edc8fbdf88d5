package com.team.issueintel.exception;

public class BrandNotAffectedException extends IssueIntelligenceException {

    public BrandNotAffectedException(String brandId, String issueId) {
        super(ErrorCode.BRAND_NOT_AFFECTED, brandId, issueId);
    }
}
