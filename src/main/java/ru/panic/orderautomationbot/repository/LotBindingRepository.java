package ru.panic.orderautomationbot.repository;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import ru.panic.orderautomationbot.model.LotBinding;

import java.util.List;

@Repository
public interface LotBindingRepository extends CrudRepository<LotBinding, Long> {
    @Query("SELECT b.* FROM lot_bindings_table b ORDER BY b.id ASC")
    List<LotBinding> findAllOrderById();
}
