package lab.reconciler.domain.cursor;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ChainCursorRepository extends JpaRepository<ChainCursor, String> {
}
