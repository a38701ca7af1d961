package com.nile.betaskca.repository.jooq;

import com.nile.betaskca.model.CartItem;
import com.nile.betaskca.model.User;
import com.nile.betaskca.repository.UserRepository;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * jOOQ-backed user store over the {@code users} and {@code cart_items} tables.
 *
 * Cart lines keep their insertion order through the {@code line_no} column;
 * a save rewrites all lines of the user.
 */
@Repository
@ConditionalOnProperty(prefix = "app-config", name = "storage", havingValue = "jooq", matchIfMissing = true)
public class JooqUserRepository implements UserRepository {

    // ── Users table ──
    private static final Table<?>       USERS        = DSL.table(DSL.name("users"));
    private static final Field<UUID>    U_ID         = DSL.field(DSL.name("users", "id"),               UUID.class);
    private static final Field<String>  U_EMAIL      = DSL.field(DSL.name("users", "email"),            String.class);
    private static final Field<String>  U_FIRST      = DSL.field(DSL.name("users", "first_name"),       String.class);
    private static final Field<String>  U_LAST       = DSL.field(DSL.name("users", "last_name"),        String.class);
    private static final Field<String>  U_PASSWORD   = DSL.field(DSL.name("users", "hashed_password"),  String.class);
    private static final Field<String>  U_ADDRESS    = DSL.field(DSL.name("users", "shipping_address"), String.class);

    // ── Cart items table ──
    private static final Table<?>       CART         = DSL.table(DSL.name("cart_items"));
    private static final Field<UUID>    C_USER_ID    = DSL.field(DSL.name("cart_items", "user_id"),  UUID.class);
    private static final Field<UUID>    C_ITEM_ID    = DSL.field(DSL.name("cart_items", "item_id"),  UUID.class);
    private static final Field<Integer> C_QTY        = DSL.field(DSL.name("cart_items", "quantity"), Integer.class);
    private static final Field<Integer> C_LINE_NO    = DSL.field(DSL.name("cart_items", "line_no"), Integer.class);

    // Unqualified fields for insert / update
    private static final Field<UUID>    ID           = DSL.field(DSL.name("id"),               UUID.class);
    private static final Field<String>  EMAIL        = DSL.field(DSL.name("email"),            String.class);
    private static final Field<String>  FIRST        = DSL.field(DSL.name("first_name"),       String.class);
    private static final Field<String>  LAST         = DSL.field(DSL.name("last_name"),        String.class);
    private static final Field<String>  PASSWORD     = DSL.field(DSL.name("hashed_password"),  String.class);
    private static final Field<String>  ADDRESS      = DSL.field(DSL.name("shipping_address"), String.class);
    private static final Field<UUID>    USER_ID      = DSL.field(DSL.name("user_id"),          UUID.class);
    private static final Field<UUID>    ITEM_ID      = DSL.field(DSL.name("item_id"),          UUID.class);
    private static final Field<Integer> QTY          = DSL.field(DSL.name("quantity"),         Integer.class);
    private static final Field<Integer> LINE_NO      = DSL.field(DSL.name("line_no"),          Integer.class);

    private final DSLContext dsl;

    public JooqUserRepository(DSLContext dsl) {
        this.dsl = dsl;
    }

    @Override
    @Transactional
    public User save(User user) {
        int updated = dsl.update(USERS)
                .set(EMAIL,    user.email())
                .set(FIRST,    user.firstName())
                .set(LAST,     user.lastName())
                .set(PASSWORD, user.hashedPassword())
                .set(ADDRESS,  user.shippingAddress())
                .where(ID.eq(user.id()))
                .execute();

        if (updated == 0) {
            dsl.insertInto(USERS)
                    .set(ID,       user.id())
                    .set(EMAIL,    user.email())
                    .set(FIRST,    user.firstName())
                    .set(LAST,     user.lastName())
                    .set(PASSWORD, user.hashedPassword())
                    .set(ADDRESS,  user.shippingAddress())
                    .execute();
        }

        // Replace existing cart lines with the ones on the entity
        dsl.deleteFrom(CART).where(USER_ID.eq(user.id())).execute();
        List<CartItem> lines = user.cartItems();
        for (int lineNo = 0; lineNo < lines.size(); lineNo++) {
            CartItem line = lines.get(lineNo);
            dsl.insertInto(CART)
                    .set(USER_ID,  line.userId())
                    .set(ITEM_ID,  line.itemId())
                    .set(QTY,      line.quantity())
                    .set(LINE_NO,  lineNo)
                    .execute();
        }
        return user;
    }

    @Override
    public Optional<User> findById(UUID userId) {
        return dsl.select(U_ID, U_EMAIL, U_FIRST, U_LAST, U_PASSWORD, U_ADDRESS)
                .from(USERS)
                .where(U_ID.eq(userId))
                .fetchOptional()
                .map(this::mapUser);
    }

    @Override
    public Optional<User> findByIdForUpdate(UUID userId) {
        return dsl.select(U_ID, U_EMAIL, U_FIRST, U_LAST, U_PASSWORD, U_ADDRESS)
                .from(USERS)
                .where(U_ID.eq(userId))
                .forUpdate()
                .fetchOptional()
                .map(this::mapUser);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return dsl.select(U_ID, U_EMAIL, U_FIRST, U_LAST, U_PASSWORD, U_ADDRESS)
                .from(USERS)
                .where(U_EMAIL.eq(email))
                .fetchOptional()
                .map(this::mapUser);
    }

    @Override
    public List<CartItem> findCartItems(UUID userId) {
        return dsl.select(C_USER_ID, C_ITEM_ID, C_QTY)
                .from(CART)
                .where(C_USER_ID.eq(userId))
                .orderBy(C_LINE_NO.asc())
                .fetch()
                .map(rec -> new CartItem(rec.get(C_USER_ID), rec.get(C_ITEM_ID), rec.get(C_QTY)));
    }

    private User mapUser(Record rec) {
        UUID id = rec.get(U_ID);
        return new User(
                id,
                rec.get(U_EMAIL),
                rec.get(U_FIRST),
                rec.get(U_LAST),
                rec.get(U_PASSWORD),
                rec.get(U_ADDRESS),
                findCartItems(id)
        );
    }
}
