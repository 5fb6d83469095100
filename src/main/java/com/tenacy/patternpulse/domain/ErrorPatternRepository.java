package com.tenacy.patternpulse.domain;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ErrorPatternRepository extends JpaRepository<ErrorPattern, String> {

    Optional<ErrorPattern> findBySignature(String signature);

    List<ErrorPattern> findBySignatureIn(Collection<String> signatures);

    List<ErrorPattern> findByStatusInOrderByLastOccurrenceDesc(Collection<PatternStatus> statuses);

    List<ErrorPattern> findByStatusInAndLastOccurrenceBefore(Collection<PatternStatus> statuses, LocalDateTime threshold);

    List<ErrorPattern> findByLastOccurrenceGreaterThanEqualOrderByLastOccurrenceDesc(LocalDateTime since);
}
