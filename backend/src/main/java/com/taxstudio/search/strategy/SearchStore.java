package com.taxstudio.search.strategy;

import com.taxstudio.common.MatchText;
import com.taxstudio.domain.FileSourceType;
import com.taxstudio.domain.Partner;
import com.taxstudio.domain.PartnerRepository;
import com.taxstudio.domain.ReceiptFile;
import com.taxstudio.domain.ReceiptFileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the document store for strategies. File queries return unassociated files only.
 */
@Component
@RequiredArgsConstructor
public class SearchStore {

    private final PartnerRepository partnerRepository;
    private final ReceiptFileRepository receiptFileRepository;

    /** Partner by id when it is global or owned by the user. */
    public Optional<Partner> findPartner(String userId, String partnerId) {
        if (partnerId == null) {
            return Optional.empty();
        }
        return partnerRepository.findById(partnerId).filter(p -> p.isVisibleTo(userId));
    }

    public List<ReceiptFile> filesReferencingPartner(String userId, Partner partner, Collection<String> emailDomains,
                                                     Collection<String> ibans, int limit) {
        return receiptFileRepository.findUnassociatedForPartner(userId, partner.getId(), emailDomains, ibans,
                MatchText.normalizeVatId(partner.getVatId()), partner.getAliases(), limit);
    }

    public List<ReceiptFile> filesWithExtractedDateBetween(String userId, Instant from, Instant to, int limit) {
        return receiptFileRepository.findUnassociatedExtractedBetween(userId, from, to, limit);
    }

    public List<ReceiptFile> mailFiles(String userId, Collection<FileSourceType> sourceTypes,
                                       Collection<String> senderDomains, Instant from, Instant to, int limit) {
        return receiptFileRepository.findUnassociatedMailFiles(userId, sourceTypes, senderDomains, from, to, limit);
    }
}
