package com.nile.betaskca.repository.jooq;

import com.nile.betaskca.model.Item;
import com.nile.betaskca.repository.ItemRepository;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * jOOQ-backed item store over the {@code items} table.
 */
@Repository
@ConditionalOnProperty(prefix = "app-config", name = "storage", havingValue = "jooq", matchIfMissing = true)
public class JooqItemRepository implements ItemRepository {

    // ── Items table ──
    private static final Table<?>           ITEMS    = DSL.table(DSL.name("items"));
    private static final Field<UUID>        I_ID     = DSL.field(DSL.name("items", "id"),          UUID.class);
    private static final Field<String>      I_NAME   = DSL.field(DSL.name("items", "name"),        String.class);
    private static final Field<String>      I_DESC   = DSL.field(DSL.name("items", "description"), String.class);
    private static final Field<BigDecimal>  I_PRICE  = DSL.field(DSL.name("items", "price"),       BigDecimal.class);
    private static final Field<Integer>     I_QTY    = DSL.field(DSL.name("items", "quantity"),    Integer.class);

    // Unqualified fields for insert / update
    private static final Field<UUID>       ID    = DSL.field(DSL.name("id"),          UUID.class);
    private static final Field<String>     NAME  = DSL.field(DSL.name("name"),        String.class);
    private static final Field<String>     DESC  = DSL.field(DSL.name("description"), String.class);
    private static final Field<BigDecimal> PRICE = DSL.field(DSL.name("price"),       BigDecimal.class);
    private static final Field<Integer>    QTY   = DSL.field(DSL.name("quantity"),    Integer.class);

    private final DSLContext dsl;

    public JooqItemRepository(DSLContext dsl) {
        this.dsl = dsl;
    }

    @Override
    @Transactional
    public Item save(Item item) {
        int updated = dsl.update(ITEMS)
                .set(NAME,  item.name())
                .set(DESC,  item.description())
                .set(PRICE, item.price())
                .set(QTY,   item.quantity())
                .where(ID.eq(item.id()))
                .execute();

        if (updated == 0) {
            dsl.insertInto(ITEMS)
                    .set(ID,    item.id())
                    .set(NAME,  item.name())
                    .set(DESC,  item.description())
                    .set(PRICE, item.price())
                    .set(QTY,   item.quantity())
                    .execute();
        }
        return item;
    }

    @Override
    public Optional<Item> findById(UUID id) {
        return dsl.select(I_ID, I_NAME, I_DESC, I_PRICE, I_QTY)
                .from(ITEMS)
                .where(I_ID.eq(id))
                .fetchOptional()
                .map(this::mapItem);
    }

    @Override
    public Optional<Item> findByName(String name) {
        return dsl.select(I_ID, I_NAME, I_DESC, I_PRICE, I_QTY)
                .from(ITEMS)
                .where(I_NAME.eq(name))
                .fetchOptional()
                .map(this::mapItem);
    }

    @Override
    public List<Item> findAll() {
        return dsl.select(I_ID, I_NAME, I_DESC, I_PRICE, I_QTY)
                .from(ITEMS)
                .orderBy(I_NAME.asc())
                .fetch()
                .map(this::mapItem);
    }

    private Item mapItem(Record rec) {
        return new Item(
                rec.get(I_ID),
                rec.get(I_NAME),
                rec.get(I_DESC),
                rec.get(I_PRICE) != null ? rec.get(I_PRICE) : BigDecimal.ZERO,
                rec.get(I_QTY) != null ? rec.get(I_QTY) : 0
        );
    }
}
