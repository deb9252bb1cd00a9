package lab.swapdesk.domain.txattempt;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TxAttemptRepository extends JpaRepository<TxAttempt, UUID> {

    List<TxAttempt> findByClientReferenceOrderByAttemptNoAsc(String clientReference);

    Optional<TxAttempt> findFirstByClientReferenceOrderByAttemptNoDesc(String clientReference);

    boolean existsByClientReference(String clientReference);
}
