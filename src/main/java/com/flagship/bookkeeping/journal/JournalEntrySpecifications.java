package com.flagship.bookkeeping.journal;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

final class JournalEntrySpecifications {

    private JournalEntrySpecifications() {
    }

    static Specification<JournalEntryEntity> matching(JournalEntryFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getFromDate() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("ledgerDate"), filter.getFromDate()));
            }
            if (filter.getToDate() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("ledgerDate"), filter.getToDate()));
            }
            if (filter.getPostingStatus() != null) {
                predicates.add(cb.equal(root.get("postingStatus"), filter.getPostingStatus()));
            }
            if (filter.getDetailAccountNumber() != null) {
                predicates.add(cb.equal(root.get("detailAccountNumber"), filter.getDetailAccountNumber()));
            }
            if (filter.getGeneralAccountNumber() != null) {
                predicates.add(cb.equal(root.get("generalAccountNumber"), filter.getGeneralAccountNumber()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
